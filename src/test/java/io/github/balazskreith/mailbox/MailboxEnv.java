package io.github.balazskreith.mailbox;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.balazskreith.mailbox.client.Correlator;
import io.github.balazskreith.mailbox.codec.*;
import io.github.balazskreith.mailbox.document.DocumentReplica;
import io.github.balazskreith.mailbox.document.ReplicatedDocument;
import io.github.balazskreith.mailbox.server.Dispatcher;
import io.reactivex.rxjava3.disposables.Disposable;

import java.util.LinkedList;
import java.util.List;

/**
 * A server and a client process sharing a queue document through two connected replicas.
 * The server keeps its users in a separate document.
 */
public class MailboxEnv {

    private final EntryCodec codec = new EntryCodec();
    private DocumentReplica serverQueue;
    private DocumentReplica clientQueue;
    private DocumentReplica users;
    private Disposable link;
    private Dispatcher<ReplicatedDocument> dispatcher;
    private Correlator correlator;
    private volatile boolean created = false;

    public MailboxEnv create() {
        if (this.created) {
            throw new IllegalStateException("Environment is already created");
        }
        this.serverQueue = DocumentReplica.builder().withContext("Server queue").build();
        this.clientQueue = DocumentReplica.builder().withContext("Client queue").build();
        this.users = DocumentReplica.builder().withContext("Users").build();
        this.link = this.clientQueue.connectTo(this.serverQueue);
        this.dispatcher = Dispatcher.<ReplicatedDocument>builder()
                .withQueue(this.serverQueue)
                .withRouter(UsersRouter.create())
                .withState(this.users)
                .withTransactor(this.users::transact)
                .withContext("Users server")
                .build();
        this.correlator = Correlator.builder()
                .withQueue(this.clientQueue)
                .withContext("Users client")
                .withCallTimeoutInMs(10000)
                .build();
        this.created = true;
        return this;
    }

    public void destroy() {
        if (!this.created) {
            return;
        }
        this.correlator.dispose();
        this.dispatcher.dispose();
        this.link.dispose();
        this.clientQueue.dispose();
        this.serverQueue.dispose();
        this.users.dispose();
        this.created = false;
    }

    public DocumentReplica getServerQueue() {
        return this.serverQueue;
    }

    public DocumentReplica getClientQueue() {
        return this.clientQueue;
    }

    public DocumentReplica getUsers() {
        return this.users;
    }

    public Dispatcher<ReplicatedDocument> getDispatcher() {
        return this.dispatcher;
    }

    public Correlator getCorrelator() {
        return this.correlator;
    }

    public List<QueueEntry> decodeAll(ReplicatedDocument queue) {
        var result = new LinkedList<QueueEntry>();
        for (JsonNode raw : queue.readAll()) {
            try {
                result.add(this.codec.decode(raw));
            } catch (EntryDecodeException ex) {
                throw new IllegalStateException("Queue has a malformed entry", ex);
            }
        }
        return result;
    }

    public List<CallEntry> getCallEntries(ReplicatedDocument queue) {
        var result = new LinkedList<CallEntry>();
        for (var entry : this.decodeAll(queue)) {
            if (entry instanceof CallEntry call) {
                result.add(call);
            }
        }
        return result;
    }

    public List<ResponseEntry> getResponseEntries(ReplicatedDocument queue) {
        var result = new LinkedList<ResponseEntry>();
        for (var entry : this.decodeAll(queue)) {
            if (entry instanceof ResponseEntry response) {
                result.add(response);
            }
        }
        return result;
    }
}
