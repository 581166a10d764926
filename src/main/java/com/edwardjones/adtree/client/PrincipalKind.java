package com.edwardjones.adtree.client;

public enum PrincipalKind {
    GROUP,
    USER,
    COMPUTER,
    OTHER
}
