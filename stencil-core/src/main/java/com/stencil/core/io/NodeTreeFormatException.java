package com.stencil.core.io;

/**
 * A node-tree document is well-formed JSON or YAML but does not describe a valid tree.
 */
public class NodeTreeFormatException extends IllegalArgumentException {

    private final String pointer;

    /**
     * Creates the error.
     *
     * @param message what is wrong
     * @param pointer JSON pointer of the offending element, e.g. {@code /nodes/2/then/0}
     */
    public NodeTreeFormatException(String message, String pointer) {
        super(message + " at " + (pointer.isEmpty() ? "/" : pointer));
        this.pointer = pointer;
    }

    /**
     * Returns the JSON pointer of the offending element.
     *
     * @return pointer, empty for the document root
     */
    public String getPointer() {
        return pointer;
    }
}
