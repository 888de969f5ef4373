package com.project.hatchmark.store;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;

@DisplayName("In-memory store")
class InMemoryOffchainStoreTest extends AbstractOffchainStoreTest {

    @BeforeEach
    void setUp() {
        InMemoryOffchainStore memory = new InMemoryOffchainStore();
        store = memory;
        cursors = memory;
    }
}
