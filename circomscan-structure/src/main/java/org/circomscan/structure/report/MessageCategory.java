package org.circomscan.structure.report;

/*
severity of a report; the declaration order is the order of importance
 */
public enum MessageCategory {
    INFO, WARNING, ERROR;

    public boolean isAtLeast(MessageCategory other) {
        return compareTo(other) >= 0;
    }

    // unknown names fall back to INFO, which lets every report through
    public static MessageCategory fromName(String name) {
        if (name != null) {
            for (MessageCategory category : values()) {
                if (category.name().equalsIgnoreCase(name.trim())) return category;
            }
        }
        return INFO;
    }
}
