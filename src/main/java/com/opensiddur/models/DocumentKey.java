package com.opensiddur.models;

public record DocumentKey(String project, String path) {

    @Override
    public String toString() {
        return project + ":" + path;
    }
}
