package com.questrail.costsource.api;

public record NameResponse(String name) {
}
