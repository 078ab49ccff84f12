package com.questrail.homeshadow.core;

/**
 * Outcome of a shadow tree mutation.
 */
public enum ApplyResult
{
    /** A stored value changed and the status feed was notified. */
    CHANGED,

    /**
     * The report was applied but no stored value changed. Control messages
     * still notify the control feed.
     */
    UNCHANGED,

    /**
     * Nothing was applied: the address is not in the shadow, or the entity kind
     * does not accept this kind of report.
     */
    IGNORED
}
