package io.github.balazskreith.mailbox.document;

import java.util.List;
import java.util.UUID;

/**
 * One atomic change of a replicated document
 *
 * @param changeId unique id of the change, replicas apply a change only once
 * @param sourceId the replica the change originated from
 * @param ops the operations applied together
 */
public record DocumentChange(UUID changeId, UUID sourceId, List<DocumentOp> ops) {

}
