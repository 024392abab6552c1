package com.example.gateway.project.model;

public record Member(int id, String name) {}
