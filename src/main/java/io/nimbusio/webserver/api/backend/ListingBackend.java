package io.nimbusio.webserver.api.backend;

import com.google.common.base.Preconditions;
import io.nimbusio.webserver.api.ids.IdentifierTranslator;
import io.nimbusio.webserver.api.ids.UnifiedId;
import io.nimbusio.webserver.api.model.Collection;
import io.nimbusio.webserver.api.model.KeyListing;
import io.nimbusio.webserver.api.model.KeyPage;
import io.nimbusio.webserver.api.model.ObjectVersion;
import io.nimbusio.webserver.api.model.PaginatedList;
import io.nimbusio.webserver.api.model.SpaceUsage;
import io.nimbusio.webserver.api.model.VersionEntry;
import org.apache.commons.lang3.StringUtils;

import javax.annotation.Nullable;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Key and version listings, and usage reports.
 */
public class ListingBackend {

    private final MetadataClient metadataClient;
    private final SpaceAccountingClient accountingClient;
    private final IdentifierTranslator identifierTranslator;
    private final DependencyCaller dependencyCaller;

    public ListingBackend(MetadataClient metadataClient,
                          SpaceAccountingClient accountingClient,
                          IdentifierTranslator identifierTranslator,
                          DependencyCaller dependencyCaller) {
        this.metadataClient = metadataClient;
        this.accountingClient = accountingClient;
        this.identifierTranslator = identifierTranslator;
        this.dependencyCaller = dependencyCaller;
    }

    public KeyPage listKeys(Collection collection,
                            @Nullable String prefix,
                            int maxKeys,
                            @Nullable String marker,
                            @Nullable String delimiter) {
        Preconditions.checkArgument(maxKeys > 0, "maxKeys must be positive");
        final KeyListing listing = dependencyCaller.call("list keys",
                () -> metadataClient.listKeys(collection.getId(), StringUtils.defaultString(prefix),
                        StringUtils.trimToNull(marker), StringUtils.defaultIfEmpty(delimiter, null), maxKeys));
        final List<VersionEntry> keyData = listing.getVersions().stream()
                .map(this::toEntry)
                .collect(Collectors.toList());
        return new KeyPage(keyData, listing.getPrefixes(), listing.isTruncated());
    }

    public PaginatedList<VersionEntry> listVersions(Collection collection,
                                                    @Nullable String prefix,
                                                    int maxKeys,
                                                    @Nullable String keyMarker,
                                                    @Nullable String versionIdentifierMarker) {
        Preconditions.checkArgument(maxKeys > 0, "maxKeys must be positive");
        final UnifiedId versionMarker = StringUtils.isEmpty(versionIdentifierMarker)
                ? null : identifierTranslator.internalId(versionIdentifierMarker);
        final List<ObjectVersion> fetched = dependencyCaller.call("list versions",
                () -> metadataClient.listVersions(collection.getId(), StringUtils.defaultString(prefix),
                        StringUtils.trimToNull(keyMarker), versionMarker, maxKeys + 1));
        return PaginatedList.fromOverfetched(fetched, maxKeys).map(this::toEntry);
    }

    public SpaceUsage getUsage(Collection collection) {
        return dependencyCaller.call("get space usage",
                () -> accountingClient.getUsage(collection.getId(), collection.getName()));
    }

    private VersionEntry toEntry(ObjectVersion version) {
        return new VersionEntry(version.getKey(), identifierTranslator.publicId(version.getVersionId()),
                version.getCreateTime(), version.getSize());
    }
}
