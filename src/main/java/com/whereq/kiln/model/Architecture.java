package com.whereq.kiln.model;

public enum Architecture {
    X86_64,
    AARCH64
}
