package io.github.cyfko.example;

import io.github.cyfko.depman.Implements;

@Implements(value = Clock.class, constructEagerly = false)
public class FixedClock implements Clock {

    private final long instant;

    public FixedClock() {
        this(0L);
    }

    public FixedClock(long instant) {
        this.instant = instant;
    }

    @Override
    public long now() {
        return instant;
    }
}
