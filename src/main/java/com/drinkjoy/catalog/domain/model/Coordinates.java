package com.drinkjoy.catalog.domain.model;

public record Coordinates(double latitude, double longitude) {}
