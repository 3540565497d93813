package com.splitttr.workspace.rest;

public record CollaborationStats(int rooms, int connections) {}
