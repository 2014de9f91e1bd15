package com.visprog.generator.model;

public enum PortDirection {
    INPUT,
    OUTPUT
}
