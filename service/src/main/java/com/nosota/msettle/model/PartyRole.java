package com.nosota.msettle.model;

/**
 * Roles that can be granted to a party by the admin.
 */
public enum PartyRole {
    /**
     * May raise disputes on any settlement.
     */
    DISPUTER
}
