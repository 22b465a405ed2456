package com.example.fileorganizer.transferlog;

import java.nio.file.Path;

public record SessionHandle(String name, Path file) {
}
