package io.github.balazskreith.mailbox.document;

import io.reactivex.rxjava3.core.Observable;
import io.reactivex.rxjava3.core.Observer;
import io.reactivex.rxjava3.disposables.CompositeDisposable;
import io.reactivex.rxjava3.disposables.Disposable;

/**
 * Carries serialized document changes between replicas.
 */
public interface DocumentTransport {

    static DocumentTransport create(Observer<byte[]> receiver, Observable<byte[]> sender) {
        return new DocumentTransport() {
            @Override
            public Observer<byte[]> getReceiver() {
                return receiver;
            }

            @Override
            public Observable<byte[]> getSender() {
                return sender;
            }
        };
    }

    Observer<byte[]> getReceiver();
    Observable<byte[]> getSender();

    /**
     * Connects the two transports in both directions.
     *
     * @param peer the transport of the remote replica
     * @return disposing it disconnects the transports
     */
    default Disposable connectTo(DocumentTransport peer) {
        var localReceiver = this.getReceiver();
        var remoteReceiver = peer.getReceiver();
        return new CompositeDisposable(
                this.getSender().subscribe(remoteReceiver::onNext),
                peer.getSender().subscribe(localReceiver::onNext)
        );
    }
}
