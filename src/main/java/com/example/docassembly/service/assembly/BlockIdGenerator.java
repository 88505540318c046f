package com.example.docassembly.service.assembly;

/**
 * Source of fresh block identifiers for lines that matched no region and for
 * injected picture/table blocks. Identifiers are map keys only and never
 * influence ordering. Implementations must be safe to call from page workers
 * running in parallel.
 */
public interface BlockIdGenerator {

    String nextId();
}
