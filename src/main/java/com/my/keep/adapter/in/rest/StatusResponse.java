package com.my.keep.adapter.in.rest;

public record StatusResponse(String status) {
}
