package com.whereq.kiln.model;

/**
 * Base distribution of the produced image
 */
public enum Distro {
    ARCH,
    DEBIAN,
    UBUNTU,
    ALPINE,
    FEDORA,
    OPENSUSE,
    VOID,
    GENTOO
}
