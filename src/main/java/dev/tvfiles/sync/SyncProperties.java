package dev.tvfiles.sync;

import dev.tvfiles.reconcile.LinkPolicy;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Settings shared by every sync pass, bound from {@code tvfiles.sync.*}.
 *
 * @param linkPolicy what to do with files whose episode cannot be resolved ({@code
 *     insert-unlinked} or {@code drop-unresolved})
 */
@Validated
@ConfigurationProperties(prefix = "tvfiles.sync")
public record SyncProperties(@NotNull @DefaultValue("insert-unlinked") LinkPolicy linkPolicy) {}
