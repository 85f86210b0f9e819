package io.chainnode.core.protocol;

import java.util.Arrays;

/**
 * Immutable 32-byte digest with value semantics, usable as a map key.
 * Ordering is unsigned lexicographic, which fork-choice uses as its tie-break.
 */
public final class Hash implements Comparable<Hash> {
    public static final int LENGTH = 32;
    public static final Hash ZERO = new Hash(new byte[LENGTH]);

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private final byte[] bytes;
    private final int hashCode;

    public Hash(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("Hash must be 32 bytes");
        }
        this.bytes = bytes.clone();
        this.hashCode = Arrays.hashCode(this.bytes);
    }

    public byte[] bytes() { return bytes.clone(); }
    public boolean isZero() { return equals(ZERO); }
    public String hex() { return toHex(bytes); }
    public String shortHex() { return hex().substring(0, 8); }

    public static String toHex(byte[] b){
        char[] out=new char[b.length*2];
        for(int i=0,j=0;i<b.length;i++){int v=b[i]&0xff;out[j++]=HEX[v>>>4];out[j++]=HEX[v&0x0f];}
        return new String(out);
    }

    @Override public int compareTo(Hash other) { return Arrays.compareUnsigned(bytes, other.bytes); }
    @Override public boolean equals(Object o){ return o instanceof Hash && Arrays.equals(bytes, ((Hash)o).bytes); }
    @Override public int hashCode(){ return hashCode; }
    @Override public String toString(){ return "Hash("+shortHex()+"…)"; }
}
