package io.chainnode.core.storage;

import io.chainnode.core.protocol.AccountState;
import io.chainnode.core.protocol.Block;
import io.chainnode.core.protocol.BlockCodec;
import io.chainnode.core.protocol.BlockMeta;
import io.chainnode.core.protocol.ChainHead;
import io.chainnode.core.protocol.Hash;
import io.chainnode.core.protocol.RecordCodec;
import io.chainnode.core.protocol.TxLocation;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.DBOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.Status;
import org.rocksdb.WriteBatch;
import org.rocksdb.WriteOptions;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Persistent LedgerStore using RocksDB.
 *
 * Layout (column families):
 *  - "blocks"     : key = blockHash(32), val = block.serialize()
 *  - "block_meta" : key = blockHash(32), val = height + cumulative work
 *  - "heights"    : key = height(8, big-endian), val = canonical blockHash(32)
 *  - "tx_index"   : key = txId(32), val = blockHash(32) + offset(4)
 *  - "accounts"   : key = address (UTF-8), val = balance(8) + nonce(8)
 *  - "meta"       : key = "head", val = hash + height + work
 *
 * Writes are synced WriteBatches. Transient statuses are retried with backoff.
 */
public final class RocksDBLedgerStore implements LedgerStore {

    private static final Logger LOG = Logger.getLogger(RocksDBLedgerStore.class.getName());

    static {
        RocksDB.loadLibrary();
    }

    private static final byte[] HEAD_KEY = "head".getBytes(StandardCharsets.UTF_8);
    private static final int MAX_ATTEMPTS = 5;
    private static final long BASE_BACKOFF_MILLIS = 10L;

    private final RocksDB db;
    private final DBOptions dbOptions;
    private final WriteOptions writeOptions;
    private final List<ColumnFamilyHandle> handles;
    private final ColumnFamilyHandle cfBlocks;
    private final ColumnFamilyHandle cfBlockMeta;
    private final ColumnFamilyHandle cfHeights;
    private final ColumnFamilyHandle cfTxIndex;
    private final ColumnFamilyHandle cfAccounts;
    private final ColumnFamilyHandle cfMeta;
    private boolean closed;

    @FunctionalInterface
    private interface RocksCall<T> {
        T run() throws RocksDBException;
    }

    private RocksDBLedgerStore(RocksDB db, DBOptions dbOptions, List<ColumnFamilyHandle> handles) {
        this.db = db;
        this.dbOptions = dbOptions;
        this.writeOptions = new WriteOptions().setSync(true);
        this.handles = handles;
        // index 0 is the default CF, unused
        this.cfBlocks = handles.get(1);
        this.cfBlockMeta = handles.get(2);
        this.cfHeights = handles.get(3);
        this.cfTxIndex = handles.get(4);
        this.cfAccounts = handles.get(5);
        this.cfMeta = handles.get(6);
    }

    /** Factory: open/create a store in the given directory path. */
    public static RocksDBLedgerStore open(String dataDir) {
        DBOptions dbOpts = new DBOptions()
                .setCreateIfMissing(true)
                .setCreateMissingColumnFamilies(true);

        List<ColumnFamilyDescriptor> cfDescs = Arrays.asList(
                new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY),
                cf("blocks"),
                cf("block_meta"),
                cf("heights"),
                cf("tx_index"),
                cf("accounts"),
                cf("meta"));
        List<ColumnFamilyHandle> cfHandles = new ArrayList<>();
        try {
            RocksDB db = RocksDB.open(dbOpts, dataDir, cfDescs, cfHandles);
            LOG.info(() -> "Opened RocksDB ledger at " + dataDir);
            return new RocksDBLedgerStore(db, dbOpts, cfHandles);
        } catch (RocksDBException e) {
            dbOpts.close();
            throw new StorageException("Failed to open RocksDB at " + dataDir, e);
        }
    }

    private static ColumnFamilyDescriptor cf(String name) {
        return new ColumnFamilyDescriptor(name.getBytes(StandardCharsets.UTF_8));
    }

    // -------------- LedgerStore API ----------------

    @Override
    public synchronized Optional<Block> getBlock(Hash hash) {
        byte[] body = get(cfBlocks, hash.bytes(), "getBlock");
        return body == null ? Optional.empty() : Optional.of(decode(() -> BlockCodec.fromBytes(body), "block"));
    }

    @Override
    public synchronized Optional<BlockMeta> getBlockMeta(Hash hash) {
        byte[] raw = get(cfBlockMeta, hash.bytes(), "getBlockMeta");
        return raw == null ? Optional.empty() : Optional.of(decode(() -> RecordCodec.decodeBlockMeta(raw), "block meta"));
    }

    @Override
    public synchronized Optional<Hash> getHashAtHeight(long height) {
        byte[] raw = get(cfHeights, RecordCodec.heightKey(height), "getHashAtHeight");
        return raw == null ? Optional.empty() : Optional.of(decode(() -> new Hash(raw), "height index"));
    }

    @Override
    public synchronized Optional<TxLocation> getTxLocation(Hash txId) {
        byte[] raw = get(cfTxIndex, txId.bytes(), "getTxLocation");
        return raw == null ? Optional.empty() : Optional.of(decode(() -> RecordCodec.decodeTxLocation(raw), "tx index"));
    }

    @Override
    public synchronized AccountState getAccount(String address) {
        byte[] raw = get(cfAccounts, address.getBytes(StandardCharsets.UTF_8), "getAccount");
        return raw == null ? AccountState.EMPTY : decode(() -> RecordCodec.decodeAccount(raw), "account");
    }

    @Override
    public synchronized Optional<ChainHead> getHead() {
        byte[] raw = get(cfMeta, HEAD_KEY, "getHead");
        return raw == null ? Optional.empty() : Optional.of(decode(() -> RecordCodec.decodeHead(raw), "head"));
    }

    @Override
    public synchronized void write(LedgerBatch batch) {
        ensureOpen();
        try (WriteBatch wb = new WriteBatch()) {
            // deletes first
            for (Long h : batch.heightDeletes()) wb.delete(cfHeights, RecordCodec.heightKey(h));
            for (Hash id : batch.txDeletes()) wb.delete(cfTxIndex, id.bytes());

            for (Map.Entry<Hash, Block> e : batch.blocks().entrySet()) {
                wb.put(cfBlocks, e.getKey().bytes(), e.getValue().serialize());
            }
            for (Map.Entry<Hash, BlockMeta> e : batch.metas().entrySet()) {
                wb.put(cfBlockMeta, e.getKey().bytes(), RecordCodec.encodeBlockMeta(e.getValue()));
            }
            for (Map.Entry<Long, Hash> e : batch.heightPuts().entrySet()) {
                wb.put(cfHeights, RecordCodec.heightKey(e.getKey()), e.getValue().bytes());
            }
            for (Map.Entry<Hash, TxLocation> e : batch.txPuts().entrySet()) {
                wb.put(cfTxIndex, e.getKey().bytes(), RecordCodec.encodeTxLocation(e.getValue()));
            }
            for (Map.Entry<String, AccountState> e : batch.accounts().entrySet()) {
                byte[] key = e.getKey().getBytes(StandardCharsets.UTF_8);
                if (e.getValue().isEmpty()) {
                    wb.delete(cfAccounts, key);
                } else {
                    wb.put(cfAccounts, key, RecordCodec.encodeAccount(e.getValue()));
                }
            }
            if (batch.head() != null) {
                wb.put(cfMeta, HEAD_KEY, RecordCodec.encodeHead(batch.head()));
            }

            withRetry("write", () -> {
                db.write(writeOptions, wb);
                return null;
            });
        } catch (RocksDBException e) {
            throw new StorageException("Failed to build write batch", e);
        }
    }

    @Override
    public synchronized long blockCount() {
        ensureOpen();
        try (RocksIterator it = db.newIterator(cfBlocks)) {
            long n = 0;
            for (it.seekToFirst(); it.isValid(); it.next()) n++;
            return n;
        }
    }

    @Override
    public synchronized void close() {
        if (closed) return;
        closed = true;
        // handles first, then DB/options
        for (ColumnFamilyHandle h : handles) {
            h.close();
        }
        db.close();
        writeOptions.close();
        dbOptions.close();
        LOG.info("RocksDB ledger closed");
    }

    // -------------- helpers ----------------

    private byte[] get(ColumnFamilyHandle cf, byte[] key, String op) {
        ensureOpen();
        return withRetry(op, () -> db.get(cf, key));
    }

    private <T> T withRetry(String op, RocksCall<T> call) {
        RocksDBException last = null;
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            try {
                return call.run();
            } catch (RocksDBException e) {
                last = e;
                if (!isTransient(e) || attempt == MAX_ATTEMPTS) {
                    break;
                }
                long backoff = BASE_BACKOFF_MILLIS << (attempt - 1);
                final int tries = attempt;
                LOG.log(Level.FINE, () -> op + " hit transient status " + e.getStatus().getCode()
                        + ", retry " + tries + " in " + backoff + "ms");
                try {
                    Thread.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new StorageException(op + " interrupted during retry", e);
                }
            }
        }
        throw new StorageException(op + " failed", last);
    }

    static boolean isTransient(RocksDBException e) {
        Status status = e.getStatus();
        if (status == null) return false;
        switch (status.getCode()) {
            case Busy:
            case TryAgain:
            case TimedOut:
            case Incomplete:
                return true;
            default:
                return false;
        }
    }

    private static <T> T decode(Supplier<T> decoder, String what) {
        try {
            return decoder.get();
        } catch (IllegalArgumentException e) {
            throw new StorageException("Corrupt " + what + " record", e);
        }
    }

    private void ensureOpen() {
        if (closed) throw new StorageException("store is closed");
    }
}
