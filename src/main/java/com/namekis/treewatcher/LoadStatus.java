package com.namekis.treewatcher;

/** How a {@link TreeLoader#load} ended. A file that could not be decoded never gets this far, see the cli package. */
public enum LoadStatus {
    LOADED,
    EMPTY_INPUT,
    NO_ROOT_FOUND,
    /** A newer load started before this one was published; nothing was applied. */
    SUPERSEDED
}
