package com.onthegomap.trailcover.cache;

import java.io.IOException;
import org.msgpack.core.MessageBufferPacker;
import org.msgpack.core.MessagePack;
import org.msgpack.core.MessagePackException;
import org.msgpack.core.MessagePacker;
import org.msgpack.core.MessageUnpacker;

/**
 * Converts an artifact to and from MessagePack bytes.
 * <p>
 * Every encoded artifact starts with a header of {@value #MAGIC}, the codec's {@link #kind()} and its
 * {@link #version()}, so an entry written by an older format, or for a different kind, is rejected instead of being
 * misread.
 *
 * @param <T> type of the artifact
 */
public interface ArtifactCodec<T> {

  String MAGIC = "trailcover";

  /** Name of the artifact kind, stored in the header. */
  String kind();

  /** Format version, bump whenever {@link #encode} changes. */
  int version();

  void encode(T value, MessagePacker packer) throws IOException;

  T decode(MessageUnpacker unpacker) throws IOException;

  /** Returns {@code value} encoded with a header. */
  default byte[] toBytes(T value) throws IOException {
    try (MessageBufferPacker packer = MessagePack.newDefaultBufferPacker()) {
      packer.packString(MAGIC);
      packer.packString(kind());
      packer.packInt(version());
      encode(value, packer);
      packer.flush();
      return packer.toByteArray();
    }
  }

  /**
   * Returns the artifact encoded in {@code bytes}.
   *
   * @throws CorruptArtifactException if the bytes are truncated, have a mismatched header, or trailing data
   */
  default T fromBytes(byte[] bytes) throws CorruptArtifactException {
    try (MessageUnpacker unpacker = MessagePack.newDefaultUnpacker(bytes)) {
      String magic = unpacker.unpackString();
      String kind = unpacker.unpackString();
      int version = unpacker.unpackInt();
      if (!MAGIC.equals(magic) || !kind().equals(kind) || version != version()) {
        throw new CorruptArtifactException(
          "expected " + MAGIC + "/" + kind() + " v" + version() + " but got " + magic + "/" + kind + " v" + version);
      }
      T result = decode(unpacker);
      if (unpacker.hasNext()) {
        throw new CorruptArtifactException("trailing data after " + kind() + " artifact");
      }
      return result;
    } catch (CorruptArtifactException e) {
      throw e;
    } catch (IOException | MessagePackException | IllegalArgumentException e) {
      throw new CorruptArtifactException("unable to decode " + kind() + " artifact: " + e, e);
    }
  }

  /** Thrown when cached bytes cannot be decoded into an artifact. */
  class CorruptArtifactException extends IOException {

    public CorruptArtifactException(String message) {
      super(message);
    }

    public CorruptArtifactException(String message, Throwable cause) {
      super(message, cause);
    }
  }
}
