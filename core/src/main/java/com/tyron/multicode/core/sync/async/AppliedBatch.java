package com.tyron.multicode.core.sync.async;

import com.tyron.multicode.api.sync.SyncException;
import com.tyron.multicode.api.sync.SyncMessage;
import com.tyron.multicode.api.sync.SyncResult;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * One debounced batch after the engine processed it.
 *
 * @param messages every message of the batch, in arrival order
 * @param result   the result of the last message that succeeded, null if none did
 * @param failures messages the engine rejected
 */
public record AppliedBatch(List<SyncMessage> messages, @Nullable SyncResult result, List<SyncException> failures) {

    public AppliedBatch {
        messages = List.copyOf(messages);
        failures = List.copyOf(failures);
    }

    public int size() {
        return messages.size();
    }
}
