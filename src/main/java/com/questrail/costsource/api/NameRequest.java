package com.questrail.costsource.api;

public record NameRequest() {
}
