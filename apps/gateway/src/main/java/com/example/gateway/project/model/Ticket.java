package com.example.gateway.project.model;

public record Ticket(int id, String message) {}
