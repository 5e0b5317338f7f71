package com.my.keep.adapter.in.rest;

public record ErrorResponse(String error) {
}
