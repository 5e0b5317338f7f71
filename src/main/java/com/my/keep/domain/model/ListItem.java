package com.my.keep.domain.model;

public record ListItem(String text, boolean checked) {
}
