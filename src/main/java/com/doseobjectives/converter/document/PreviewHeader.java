package com.doseobjectives.converter.document;

/**
 * Attributes of the {@code Preview} element the importer shows in its template list.
 */
public final class PreviewHeader {

    public static final String VERSION = "1.2";
    public static final String TYPE = "DoseObjectives";
    public static final String APPROVAL_STATUS = "Unapproved";

    private final String id;
    private final String description;
    private final String assignedUsers;
    private final String lastModified;

    public PreviewHeader(String id, String description, String assignedUsers, String lastModified) {
        this.id = id;
        this.description = description;
        this.assignedUsers = assignedUsers;
        this.lastModified = lastModified;
    }

    public String getId() {
        return id;
    }

    public String getDescription() {
        return description;
    }

    public String getAssignedUsers() {
        return assignedUsers;
    }

    public String getLastModified() {
        return lastModified;
    }

    public String getApprovalHistory() {
        return "Created [ " + lastModified + " ]";
    }
}
