package io.github.yok.flexdbsync.core;

import io.github.yok.flexdbsync.model.TableDescriptor;
import lombok.Value;

/**
 * A source table paired with its counterpart in the destination.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class MirroredTable {

    // Name passed by the caller
    String requestedName;

    // Structure read from the source
    TableDescriptor source;

    // Table name as spelled by the destination catalog
    String destinationName;

    // Whether the destination table was created by this run
    boolean created;
}
