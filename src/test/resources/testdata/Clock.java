package io.github.cyfko.example;

public interface Clock {

    long now();
}
