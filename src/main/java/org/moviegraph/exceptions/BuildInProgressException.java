package org.moviegraph.exceptions;

/**
 * A rebuild was requested while another one holds the writer.
 */
public class BuildInProgressException extends IllegalStateException {

    public BuildInProgressException() {
        super("A schema build is already running");
    }
}
