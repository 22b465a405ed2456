package com.example.fileorganizer.classify;

public record LevelMatch(String directory, String reason) {
}
