package com.eyelevel.invoiceprocessor.common.json;

/**
 * Defines the contract for serializing Java objects into JSON data.
 */
public interface JsonSerializer {

    /**
     * Serializes a Java object into its JSON representation.
     *
     * @param object The Java object to serialize.
     * @param <T>    The type of the Java object.
     *
     * @return The JSON representation of the object as a string.
     *
     * @throws com.eyelevel.invoiceprocessor.exception.json.JsonParsingException if serialization fails.
     */
    <T> String serialize(T object);

    /**
     * Serializes a Java object into its JSON representation.
     *
     * @param object      The Java object to serialize.
     * @param prettyPrint whether to format the JSON with indentation and line breaks.
     * @param <T>         The type of the Java object.
     *
     * @return The JSON representation of the object as a string.
     *
     * @throws com.eyelevel.invoiceprocessor.exception.json.JsonParsingException if serialization fails.
     */
    <T> String serialize(T object, boolean prettyPrint);
}
