package com.vidnyan.grammarian.domain.rewrite;

public enum MovePosition {
    BEFORE,
    AFTER
}
