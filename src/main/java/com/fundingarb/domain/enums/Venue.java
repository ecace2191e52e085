package com.fundingarb.domain.enums;

/** The two trading venues the engine hedges across. Venue selection is fixed by configuration. */
public enum Venue {
    LIGHTER,
    X10;

    /** Returns the venue on the other side of the hedge. */
    public Venue other() {
        return this == LIGHTER ? X10 : LIGHTER;
    }
}
