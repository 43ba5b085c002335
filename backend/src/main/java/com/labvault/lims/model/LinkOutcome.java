package com.labvault.lims.model;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Result of associating one imported sample row with a specimen record.
 * Each variant carries exactly the data its link status allows.
 */
public interface LinkOutcome {

    LinkStatus status();

    record Linked(Long specimenId, LocalDateTime linkedAt) implements LinkOutcome {
        public Linked {
            Objects.requireNonNull(specimenId, "specimenId must not be null");
            Objects.requireNonNull(linkedAt, "linkedAt must not be null");
        }

        @Override
        public LinkStatus status() { return LinkStatus.LINKED; }
    }

    record NoMatch(String reason) implements LinkOutcome {
        public NoMatch {
            Objects.requireNonNull(reason, "reason must not be null");
        }

        @Override
        public LinkStatus status() { return LinkStatus.NO_MATCH; }
    }

    record Failed(String error) implements LinkOutcome {
        public Failed {
            Objects.requireNonNull(error, "error must not be null");
        }

        @Override
        public LinkStatus status() { return LinkStatus.FAILED; }
    }
}
