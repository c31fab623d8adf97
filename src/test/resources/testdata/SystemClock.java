package io.github.cyfko.example;

import io.github.cyfko.depman.Implements;

@Implements(Clock.class)
public class SystemClock implements Clock {

    @Override
    public long now() {
        return System.currentTimeMillis();
    }
}
