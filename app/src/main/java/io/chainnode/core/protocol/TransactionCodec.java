package io.chainnode.core.protocol;

import java.nio.ByteBuffer;
import java.security.PublicKey;
import java.util.Arrays;

public final class TransactionCodec {
    private TransactionCodec(){}

    public static Transaction fromBytes(byte[] bytes) {
        if (bytes == null) throw new MalformedEncodingException("Malformed Transaction bytes: null");
        ByteBuffer buf = ByteBuffer.wrap(bytes);
        Transaction tx = read(buf);
        Encoding.requireFullyConsumed(buf, "Transaction");
        return tx;
    }

    /** Reads one transaction from the current position; the caller checks for trailing data. */
    public static Transaction read(ByteBuffer buf) {
        try {
            int version = Encoding.readInt(buf);
            int chainId = Encoding.readInt(buf);
            String from = Encoding.readString(buf, ProtocolLimits.MAX_ADDRESS_LEN);
            String to = Encoding.readString(buf, ProtocolLimits.MAX_ADDRESS_LEN);
            long amountMinor = Encoding.readLong(buf);
            long feeMinor = Encoding.readLong(buf);
            long nonce = Encoding.readLong(buf);
            long timestamp = Encoding.readLong(buf);
            byte[] payload = Encoding.readBytes(buf, ProtocolLimits.MAX_PAYLOAD_BYTES);
            byte[] encodedKey = Encoding.readBytes(buf, ProtocolLimits.MAX_PUBLIC_KEY_BYTES);
            byte[] signature = Encoding.readBytes(buf, ProtocolLimits.MAX_SIGNATURE_BYTES);

            PublicKey publicKey = encodedKey.length == 0 ? null : SignatureUtil.decodePublicKey(encodedKey);

            Transaction tx = Transaction.builder()
                    .version(version)
                    .chainId(chainId)
                    .from(from)
                    .to(to)
                    .amountMinor(amountMinor)
                    .feeMinor(feeMinor)
                    .nonce(nonce)
                    .timestamp(timestamp)
                    .payload(payload)
                    .signature(signature)
                    .publicKey(publicKey)
                    .build();
            if (publicKey != null && !Arrays.equals(publicKey.getEncoded(), encodedKey)) {
                throw new MalformedEncodingException("Public key is not canonically encoded");
            }
            return tx;
        } catch (MalformedEncodingException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new MalformedEncodingException("Malformed Transaction bytes", ex);
        }
    }
}
