package edu.brandeis.cosi103a.lycans.report;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.guava.GuavaModule;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;

/**
 * Shared ObjectMapper factory so the CLI and the viewer read game logs and write reports
 * the same way.
 */
public final class ObjectMapperFactory {

    private ObjectMapperFactory() {
        // Utility class
    }

    /**
     * Creates an ObjectMapper with Guava and JDK8 module support. Unknown game log fields are
     * ignored since exports from newer mod versions add fields freely.
     */
    public static ObjectMapper create() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new GuavaModule());
        mapper.registerModule(new Jdk8Module());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    /** Same as {@link #create()}, pretty-printing its output. */
    public static ObjectMapper createIndenting() {
        return create().enable(SerializationFeature.INDENT_OUTPUT);
    }
}
