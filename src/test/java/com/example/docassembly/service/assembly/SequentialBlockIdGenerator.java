package com.example.docassembly.service.assembly;

import java.util.concurrent.atomic.AtomicInteger;

class SequentialBlockIdGenerator implements BlockIdGenerator {

    private final AtomicInteger counter = new AtomicInteger();

    @Override
    public String nextId() {
        return "gen-" + counter.incrementAndGet();
    }
}
