package com.example.gateway.project.model;

public record Project(int id, String name) {}
