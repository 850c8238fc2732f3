package com.registry.api.security;

/**
 * Capability names checked by the REST surface.
 */
public final class Capabilities {

    public static final String VIEW_ENTITIES = "view_entities";
    public static final String CREATE_ENTITY = "create_entity";
    public static final String EDIT_ENTITY = "edit_entity";
    public static final String DELETE_ENTITY = "delete_entity";

    public static final String VIEW_ENTITY_RECORDS = "view_entity_records";
    public static final String CREATE_ENTITY_RECORD = "create_entity_record";
    public static final String EDIT_ENTITY_RECORD = "edit_entity_record";
    public static final String DELETE_ENTITY_RECORD = "delete_entity_record";

    public static final String WILDCARD = "*";

    private Capabilities() {
    }
}
