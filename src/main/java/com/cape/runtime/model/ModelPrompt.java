package com.cape.runtime.model;

/**
 * A rendered prompt.
 *
 * @param system instructions describing the capability
 * @param user   inputs and task section
 */
public record ModelPrompt(String system, String user) {

    /**
     * Both parts joined, for adapters that take a single text.
     */
    public String text() {
        return system + "\n\n" + user;
    }
}
