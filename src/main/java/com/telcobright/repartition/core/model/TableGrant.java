package com.telcobright.repartition.core.model;

import java.util.Objects;

/**
 * Object privilege held on a table, captured before cutover and reapplied
 * to the table that ends up holding the canonical name.
 */
public final class TableGrant {

    private final String grantee;
    private final String privilege;
    private final boolean grantable;

    public TableGrant(String grantee, String privilege, boolean grantable) {
        this.grantee = Objects.requireNonNull(grantee, "grantee");
        this.privilege = Objects.requireNonNull(privilege, "privilege");
        this.grantable = grantable;
    }

    public String getGrantee() { return grantee; }
    public String getPrivilege() { return privilege; }
    public boolean isGrantable() { return grantable; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TableGrant)) return false;
        TableGrant that = (TableGrant) o;
        return grantable == that.grantable && grantee.equals(that.grantee) && privilege.equals(that.privilege);
    }

    @Override
    public int hashCode() {
        return Objects.hash(grantee, privilege, grantable);
    }

    @Override
    public String toString() {
        return privilege + " TO " + grantee + (grantable ? " WITH GRANT OPTION" : "");
    }
}
