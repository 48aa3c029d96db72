package com.whereq.kiln.model;

public enum InitSystem {
    SYSTEMD,
    OPENRC,
    RUNIT,
    S6
}
