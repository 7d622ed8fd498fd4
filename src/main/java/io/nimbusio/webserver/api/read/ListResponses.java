package io.nimbusio.webserver.api.read;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.nimbusio.webserver.api.model.ConjoinedEntry;
import io.nimbusio.webserver.api.model.ConjoinedPart;
import io.nimbusio.webserver.api.model.PaginatedList;
import io.nimbusio.webserver.api.model.VersionEntry;

import java.time.Instant;
import java.util.List;

/**
 * JSON bodies of the listing requests.
 */
final class ListResponses {

    private ListResponses() {

    }

    static final class VersionList {
        private final PaginatedList<VersionEntry> page;

        VersionList(PaginatedList<VersionEntry> page) {
            this.page = page;
        }

        @JsonProperty("key_data")
        public List<VersionEntry> getKeyData() {
            return page.getItems();
        }

        @JsonProperty("truncated")
        public boolean isTruncated() {
            return page.isTruncated();
        }
    }

    static final class ConjoinedList {
        private final PaginatedList<ConjoinedEntry> page;

        ConjoinedList(PaginatedList<ConjoinedEntry> page) {
            this.page = page;
        }

        @JsonProperty("conjoined_list")
        public List<ConjoinedEntry> getConjoinedList() {
            return page.getItems();
        }

        @JsonProperty("truncated")
        public boolean isTruncated() {
            return page.isTruncated();
        }
    }

    static final class UploadList {
        private final PaginatedList<Upload> page;

        UploadList(PaginatedList<ConjoinedPart> parts) {
            this.page = parts.map(Upload::new);
        }

        @JsonProperty("upload_list")
        public List<Upload> getUploadList() {
            return page.getItems();
        }

        @JsonProperty("truncated")
        public boolean isTruncated() {
            return page.isTruncated();
        }
    }

    static final class Upload {
        private final ConjoinedPart part;

        Upload(ConjoinedPart part) {
            this.part = part;
        }

        @JsonProperty("part_number")
        public int getPartNumber() {
            return part.getPartNumber();
        }

        @JsonProperty("size")
        public long getSize() {
            return part.getSize();
        }

        @JsonProperty("timestamp")
        public Instant getTimestamp() {
            return part.getCreateTime();
        }
    }
}
