package io.nosqlbench.commp.cid;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import org.apache.commons.codec.CodecPolicy;
import org.apache.commons.codec.binary.Base32;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Locale;

/// An immutable version 1 content identifier, as used for piece commitments.
///
/// The binary layout is
/// ```
/// varint(1) varint(codec) varint(multihash type) varint(digest length) digest
/// ```
/// and the display form is the multibase base32 encoding of those bytes: lower case,
/// no padding, prefixed with `b`. A piece commitment therefore always renders with the
/// prefix `baga6ea4se`.
public final class PieceCid {

    /// multicodec `fil-commitment-unsealed`
    public static final long FIL_COMMITMENT_UNSEALED = 0xf101;

    /// multicodec `fil-commitment-sealed`
    public static final long FIL_COMMITMENT_SEALED = 0xf102;

    /// multihash `sha2-256-trunc254-padded`
    public static final long SHA2_256_TRUNC254_PADDED = 0x1012;

    private static final long CID_VERSION = 1;
    private static final char MULTIBASE_BASE32 = 'b';
    /// strict decoding rejects text whose last character carries non-zero unused bits
    private static final Base32 BASE32 = new Base32(0, null, false, (byte) '=', CodecPolicy.STRICT);

    private final byte[] bytes;
    private final long codec;
    private final long multihashType;
    private final byte[] digest;
    private final String text;

    private PieceCid(byte[] bytes, long codec, long multihashType, byte[] digest) {
        this.bytes = bytes;
        this.codec = codec;
        this.multihashType = multihashType;
        this.digest = digest;
        this.text = MULTIBASE_BASE32
            + BASE32.encodeAsString(bytes).replace("=", "").toLowerCase(Locale.ROOT);
    }

    /// Builds a CID from its parts.
    /// @param codec the content multicodec
    /// @param multihashType the multihash function code
    /// @param digest the raw digest, copied
    /// @return the CID
    public static PieceCid of(long codec, long multihashType, byte[] digest) {
        if (digest == null || digest.length == 0) {
            throw new IllegalArgumentException("a CID digest must not be empty");
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream(8 + digest.length);
        Varint.write(CID_VERSION, out);
        Varint.write(codec, out);
        Varint.write(multihashType, out);
        Varint.write(digest.length, out);
        out.write(digest, 0, digest.length);
        return new PieceCid(out.toByteArray(), codec, multihashType, digest.clone());
    }

    /// Parses the binary form of a version 1 CID.
    /// @param cidBytes the binary CID
    /// @return the CID
    /// @throws IllegalArgumentException if the bytes are not a well formed version 1 CID
    public static PieceCid fromBytes(byte[] cidBytes) {
        if (cidBytes == null || cidBytes.length == 0) {
            throw new IllegalArgumentException("empty CID");
        }
        ByteBuffer in = ByteBuffer.wrap(cidBytes);
        long version = Varint.read(in);
        if (version != CID_VERSION) {
            throw new IllegalArgumentException("unsupported CID version " + version);
        }
        long codec = Varint.read(in);
        long multihashType = Varint.read(in);
        long length = Varint.read(in);
        if (length != in.remaining()) {
            throw new IllegalArgumentException(
                "multihash declares " + length + " digest bytes but " + in.remaining() + " remain");
        }
        if (length == 0) {
            throw new IllegalArgumentException("a CID digest must not be empty");
        }
        byte[] digest = new byte[(int) length];
        in.get(digest);
        return new PieceCid(cidBytes.clone(), codec, multihashType, digest);
    }

    /// Parses the multibase base32 display form.
    /// @param text the display form, starting with `b`
    /// @return the CID
    /// @throws IllegalArgumentException if the text is not a base32 version 1 CID
    public static PieceCid parse(String text) {
        if (text == null || text.length() < 2) {
            throw new IllegalArgumentException("not a CID: '" + text + "'");
        }
        if (text.charAt(0) != MULTIBASE_BASE32) {
            throw new IllegalArgumentException(
                "unsupported multibase prefix '" + text.charAt(0) + "' in " + text);
        }
        String body = text.substring(1).toUpperCase(Locale.ROOT);
        if (!BASE32.isInAlphabet(body)) {
            throw new IllegalArgumentException("invalid base32 characters in " + text);
        }
        byte[] decoded;
        try {
            decoded = BASE32.decode(body);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("non-canonical base32 in " + text, e);
        }
        return fromBytes(decoded);
    }

    /// @return a copy of the binary CID
    public byte[] bytes() {
        return bytes.clone();
    }

    /// @return a copy of the raw digest carried in the multihash
    public byte[] digest() {
        return digest.clone();
    }

    public long codec() {
        return codec;
    }

    public long multihashType() {
        return multihashType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PieceCid)) {
            return false;
        }
        return Arrays.equals(bytes, ((PieceCid) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    /// @return the multibase base32 display form
    @Override
    public String toString() {
        return text;
    }
}
