package org.circomscan.structure.report;

import org.circomscan.structure.file.FileLocation;
import org.circomscan.structure.file.Meta;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/*
One diagnostic. Immutable; use the Builder obtained from error(), warning() or info().
 */
public final class Report {

    public record Label(int fileId, FileLocation location, String message) {
        public Label {
            Objects.requireNonNull(location);
        }

        @Override
        public String toString() {
            return fileId + ":" + location + (message == null ? "" : " " + message);
        }
    }

    private final MessageCategory category;
    private final ReportCode code;
    private final String message;
    private final List<Label> primary;
    private final List<Label> secondary;
    private final List<String> notes;

    private Report(Builder builder) {
        this.category = builder.category;
        this.code = builder.code;
        this.message = builder.message;
        this.primary = List.copyOf(builder.primary);
        this.secondary = List.copyOf(builder.secondary);
        this.notes = List.copyOf(builder.notes);
    }

    public static Builder error(String message, ReportCode code) {
        return new Builder(MessageCategory.ERROR, message, code);
    }

    public static Builder warning(String message, ReportCode code) {
        return new Builder(MessageCategory.WARNING, message, code);
    }

    public static Builder info(String message, ReportCode code) {
        return new Builder(MessageCategory.INFO, message, code);
    }

    public MessageCategory category() {
        return category;
    }

    public ReportCode code() {
        return code;
    }

    public String id() {
        return code.id();
    }

    public String message() {
        return message;
    }

    public List<Label> primary() {
        return primary;
    }

    public List<Label> secondary() {
        return secondary;
    }

    public List<String> notes() {
        return notes;
    }

    public boolean isError() {
        return category == MessageCategory.ERROR;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(category).append(" [").append(code.id()).append("]: ").append(message);
        primary.forEach(label -> sb.append("\n  primary ").append(label));
        secondary.forEach(label -> sb.append("\n  secondary ").append(label));
        notes.forEach(note -> sb.append("\n  note: ").append(note));
        return sb.toString();
    }

    public static class Builder {
        private final MessageCategory category;
        private final String message;
        private final ReportCode code;
        private final List<Label> primary = new ArrayList<>();
        private final List<Label> secondary = new ArrayList<>();
        private final List<String> notes = new ArrayList<>();

        private Builder(MessageCategory category, String message, ReportCode code) {
            this.category = Objects.requireNonNull(category);
            this.message = Objects.requireNonNull(message);
            this.code = Objects.requireNonNull(code);
        }

        public Builder addPrimary(Meta meta, String labelMessage) {
            return addPrimary(meta.location(), meta.fileId(), labelMessage);
        }

        public Builder addPrimary(FileLocation location, int fileId, String labelMessage) {
            primary.add(new Label(fileId, location, labelMessage));
            return this;
        }

        public Builder addSecondary(Meta meta, String labelMessage) {
            return addSecondary(meta.location(), meta.fileId(), labelMessage);
        }

        // the label message is optional for secondary locations
        public Builder addSecondary(FileLocation location, int fileId, String labelMessage) {
            secondary.add(new Label(fileId, location, labelMessage));
            return this;
        }

        public Builder addNote(String note) {
            notes.add(note);
            return this;
        }

        public Report build() {
            return new Report(this);
        }
    }
}
