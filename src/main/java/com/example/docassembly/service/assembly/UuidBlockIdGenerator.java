package com.example.docassembly.service.assembly;

import org.springframework.stereotype.Component;

import java.util.UUID;

@Component
public class UuidBlockIdGenerator implements BlockIdGenerator {

    @Override
    public String nextId() {
        return UUID.randomUUID().toString();
    }
}
