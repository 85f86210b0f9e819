package io.chainnode.core.p2p;

import io.chainnode.core.chain.ApplyResult;
import io.chainnode.core.chain.ChainManager;
import io.chainnode.core.mempool.Mempool;
import io.chainnode.core.protocol.Block;
import io.chainnode.core.protocol.ChainHead;
import io.chainnode.core.protocol.Hash;
import io.chainnode.core.protocol.ProtocolError;
import io.chainnode.core.protocol.ProtocolLimits;
import io.chainnode.core.protocol.Transaction;
import io.chainnode.core.protocol.ValidationResult;
import io.chainnode.core.protocol.messages.Message;
import io.chainnode.core.storage.StorageException;

import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Per-message protocol logic. Runs on the worker pool, serially per session, so the methods
 * here may block on chain validation without stalling any event loop.
 */
final class ProtocolHandler {
    private static final Logger LOG = Logger.getLogger(ProtocolHandler.class.getName());

    // room for the tag and the block count next to the serialized blocks
    private static final int BLOCKS_FRAME_OVERHEAD = 1024;

    private final P2pServer server;
    private final P2pConfig config;
    private final ChainManager chain;
    private final Mempool mempool;

    ProtocolHandler(P2pServer server, P2pConfig config, ChainManager chain, Mempool mempool) {
        this.server = server;
        this.config = config;
        this.chain = chain;
        this.mempool = mempool;
    }

    Message.Hello localHello() {
        ChainHead head = chain.head();
        return new Message.Hello(ProtocolLimits.PROTOCOL_VERSION, config.nodeId, head.hash(), head.height());
    }

    void handle(PeerSession session, Message message) {
        if (!session.state().isReady()
                && !(message instanceof Message.Hello)
                && !(message instanceof Message.Reject)) {
            LOG.fine(() -> "Rejecting " + message.getClass().getSimpleName() + " before handshake from " + session);
            session.send(new Message.Reject(ProtocolError.MALFORMED_ENCODING, "handshake required"));
            return;
        }
        server.notifyMessage(session, message);
        message.accept(new SessionVisitor(session));
    }

    /** Ask the peer for the canonical blocks after {@code from}. */
    void requestBlocks(PeerSession session, Hash from) {
        int count = config.syncBatchSize;
        session.startSync(from, count);
        LOG.fine(() -> "Requesting " + count + " blocks after " + from.shortHex() + " from " + session);
        session.send(new Message.GetBlocks(from, count));
    }

    private final class SessionVisitor implements Message.Visitor<Void> {
        private final PeerSession session;

        SessionVisitor(PeerSession session) {
            this.session = session;
        }

        @Override
        public Void visitHello(Message.Hello m) {
            if (session.state().isReady()) {
                LOG.fine(() -> "Ignoring repeated Hello from " + session);
                return null;
            }
            if (m.version() < ProtocolLimits.MIN_PROTOCOL_VERSION) {
                LOG.info(() -> "Peer " + session.remoteAddress() + " speaks version " + m.version() + ", closing");
                session.sendAndClose(new Message.Reject(ProtocolError.PROTOCOL_VERSION_MISMATCH,
                        "minimum supported version is " + ProtocolLimits.MIN_PROTOCOL_VERSION));
                return null;
            }
            if (m.nodeId().equals(config.nodeId)) {
                LOG.fine(() -> "Closing self-connection via " + session.remoteAddress());
                session.close();
                return null;
            }
            int negotiated = Math.min(m.version(), ProtocolLimits.PROTOCOL_VERSION);
            session.completeHandshake(m.nodeId(), negotiated, m.headHash(), m.height());
            if (!server.registerPeer(session)) {
                LOG.fine(() -> "Closing duplicate connection to " + m.nodeId());
                session.setState(PeerState.DISCONNECTED);
                session.close();
                return null;
            }

            // Hello carries no work, and a shorter chain may still be the heavier one
            if (!chain.hasBlock(m.headHash())) {
                requestBlocks(session, chain.head().hash());
            }
            return null;
        }

        @Override
        public Void visitPing(Message.Ping m) {
            session.send(new Message.Pong(m.nonce()));
            return null;
        }

        @Override
        public Void visitPong(Message.Pong m) {
            return null;
        }

        @Override
        public Void visitInvBlock(Message.InvBlock m) {
            Hash hash = m.hash();
            if (chain.hasBlock(hash) || chain.isOrphan(hash)) {
                return null;
            }
            session.notePeerHead(hash, session.peerHeight());
            if (!session.isSyncing()) {
                requestBlocks(session, chain.head().hash());
            }
            return null;
        }

        @Override
        public Void visitInvTx(Message.InvTx m) {
            Hash id = m.txId();
            if (mempool.contains(id) || chain.getTxLocation(id).isPresent()) {
                return null;
            }
            session.send(new Message.GetTx(id));
            return null;
        }

        @Override
        public Void visitGetBlocks(Message.GetBlocks m) {
            int count = Math.min(m.count(), ProtocolLimits.MAX_BLOCKS_PER_MESSAGE);
            long budget = (long) config.maxFrameBytes - BLOCKS_FRAME_OVERHEAD;
            Optional<List<Block>> blocks = chain.blocksAfter(m.fromHash(), count, budget);
            if (blocks.isEmpty()) {
                session.send(new Message.Reject(ProtocolError.UNKNOWN_PARENT, "unknown locator " + m.fromHash().hex()));
                return null;
            }
            session.send(new Message.Blocks(blocks.get()));
            return null;
        }

        @Override
        public Void visitBlocks(Message.Blocks m) {
            List<Block> blocks = m.blocks();
            boolean wasSyncing = session.isSyncing();
            int requested = session.syncRequested();

            for (int i = 1; i < blocks.size(); i++) {
                Block prev = blocks.get(i - 1);
                Block cur = blocks.get(i);
                if (!cur.header().parent().equals(prev.hash()) || cur.height() != prev.height() + 1) {
                    LOG.warning(() -> "Discarding non-consecutive block batch from " + session);
                    session.send(new Message.Reject(ProtocolError.MALFORMED_ENCODING, "non-consecutive block batch"));
                    session.finishSync();
                    return null;
                }
            }

            Block lastConnected = null;
            for (Block block : blocks) {
                if (!session.isActive()) {
                    LOG.fine(() -> "Peer " + session + " went away mid-batch, discarding the rest");
                    return null;
                }
                ApplyResult result;
                try {
                    result = chain.applyBlock(block);
                } catch (StorageException e) {
                    LOG.log(Level.SEVERE, "Storage failure while applying block from " + session, e);
                    session.finishSync();
                    return null;
                }
                switch (result.status()) {
                    case APPLIED:
                    case REORGANIZED:
                    case SIDE_CHAIN:
                    case DUPLICATE:
                        lastConnected = block;
                        session.notePeerHead(block.hash(), block.height());
                        break;
                    case ORPHAN:
                        LOG.fine(() -> "Orphan " + block.hash().shortHex() + " from " + session + ", fetching from local head");
                        requestBlocks(session, chain.head().hash());
                        return null;
                    case REJECTED:
                    default:
                        LOG.info(() -> "Block from " + session + " rejected: " + result);
                        session.send(new Message.Reject(result.error(), result.message()));
                        session.finishSync();
                        return null;
                }
            }

            if (!wasSyncing) {
                return null;
            }
            boolean more = lastConnected != null
                    && (blocks.size() >= requested || chain.head().height() < session.peerHeight());
            if (more) {
                requestBlocks(session, lastConnected.hash());
            } else {
                session.finishSync();
                LOG.fine(() -> "Sync with " + session + " finished at " + chain.head());
            }
            return null;
        }

        @Override
        public Void visitGetTx(Message.GetTx m) {
            Optional<Transaction> tx = mempool.get(m.txId());
            if (tx.isEmpty()) {
                tx = chain.getTransaction(m.txId());
            }
            if (tx.isPresent()) {
                session.send(new Message.Tx(tx.get()));
            } else {
                LOG.fine(() -> "Peer " + session + " asked for unknown tx " + m.txId().shortHex());
            }
            return null;
        }

        @Override
        public Void visitTx(Message.Tx m) {
            ValidationResult r = mempool.admit(m.tx());
            if (!r.ok && r.error != ProtocolError.DUPLICATE) {
                session.send(new Message.Reject(r.error, r.message));
            }
            return null;
        }

        @Override
        public Void visitReject(Message.Reject m) {
            LOG.info(() -> "Peer " + session + " rejected: " + m.code() + " " + m.context());
            if (m.code() == ProtocolError.PROTOCOL_VERSION_MISMATCH) {
                session.close();
            } else if (m.code() == ProtocolError.UNKNOWN_PARENT && session.isSyncing()) {
                stepBackLocator();
            }
            return null;
        }

        /** Exponential walk back toward genesis after the peer did not know our locator. */
        private void stepBackLocator() {
            Hash previous = session.syncFrom();
            if (previous != null && previous.equals(chain.genesisHash())) {
                LOG.warning(() -> "Peer " + session + " does not know our genesis, giving up sync");
                session.finishSync();
                return;
            }
            long step = session.nextLocatorStep();
            long height = Math.max(0, chain.head().height() - step);
            Hash locator = chain.getHashAtHeight(height).orElse(chain.genesisHash());
            int count = config.syncBatchSize;
            session.startSync(locator, count);
            session.send(new Message.GetBlocks(locator, count));
        }
    }
}
