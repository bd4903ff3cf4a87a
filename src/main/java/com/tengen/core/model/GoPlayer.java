package com.tengen.core.model;

public record GoPlayer(String name, GoColor color, boolean human) {

    public boolean isComputer() {
        return !human;
    }
}
