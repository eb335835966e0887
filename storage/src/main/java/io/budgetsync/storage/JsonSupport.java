// file: storage/src/main/java/io/budgetsync/storage/JsonSupport.java
package io.budgetsync.storage;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Shared Jackson setup for every document the engine reads or writes.
 * <p>
 *  - Unknown fields are ignored on read (newer writers may add fields).
 *  - Fractional numbers are rejected for integer fields; amounts are minor units.
 *  - Null fields are omitted on write.
 *  - Output is indented: segments are small, human-readable records.
 */
final class JsonSupport {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.ACCEPT_FLOAT_AS_INT, false)
            .setDefaultPropertyInclusion(JsonInclude.Include.NON_NULL)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private JsonSupport() {
        // utility
    }

    static ObjectMapper mapper() {
        return MAPPER;
    }
}
