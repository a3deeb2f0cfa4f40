package com.example.rls.fieldaccess;

/**
 * Access applied to fields a table does not configure explicitly.
 */
public enum FieldAccessDefault {
    ALLOW,
    DENY
}
