package com.contextsmith.daac.utils;

import static com.google.common.base.Preconditions.checkNotNull;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.contextsmith.daac.AutomatonSerializer;
import com.contextsmith.daac.DoubleArrayAhoCorasick;
import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.KryoException;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;
import com.google.common.base.Stopwatch;

/**
 * Kryo-based serialize and deserialize helpers for automata. Kryo instances
 * are not thread safe, so each thread gets its own.
 */
public class SerializationUtil {

  protected static final Logger log = LogManager.getLogger(SerializationUtil.class);

  protected static final ThreadLocal<Kryo> KRYOS = ThreadLocal.withInitial(() -> {
    Kryo kryo = new Kryo();
    kryo.setRegistrationRequired(true);
    kryo.register(DoubleArrayAhoCorasick.class, new AutomatonSerializer());
    return kryo;
  });

  public static <T> T deserialize(byte[] bytes, Class<T> type) throws IOException {
    return deserialize(new ByteArrayInputStream(bytes), type);
  }

  public static <T> T deserialize(InputStream is, Class<T> type) throws IOException {
    checkNotNull(is);
    checkNotNull(type);
    try (Input input = new Input(is)) {
      return KRYOS.get().readObject(input, type);
    } catch (KryoException e) {
      throw new IOException("Could not deserialize " + type.getSimpleName(), e);
    }
  }

  // Deserialize to Object from the given file.
  public static <T> T deserialize(String filePath, Class<T> type)
      throws IOException {
    log.info("Deserializing \"{}\" ({})...",
             filePath, FileUtil.getReadableFileSize(filePath));
    Stopwatch stopwatch = Stopwatch.createStarted();
    T object = deserialize(new FileInputStream(filePath), type);
    log.info("Deserialized \"{}\" in {}", filePath, stopwatch);
    return object;
  }

  public static byte[] serialize(Object object) throws IOException {
    ByteArrayOutputStream baos = new ByteArrayOutputStream();
    serialize(object, baos);
    return baos.toByteArray();
  }

  public static void serialize(Object object, OutputStream os) throws IOException {
    checkNotNull(object);
    checkNotNull(os);
    try (Output output = new Output(os)) {
      KRYOS.get().writeObject(output, object);
    } catch (KryoException e) {
      throw new IOException("Could not serialize " + object.getClass().getSimpleName(), e);
    }
  }

  // Serialize the given object and save it to a file.
  public static void serialize(Object object, String filePath) throws IOException {
    log.info("Serializing \"{}\"...", filePath);
    Stopwatch stopwatch = Stopwatch.createStarted();
    serialize(object, new FileOutputStream(filePath));
    log.info("Serialized \"{}\" ({}) in {}",
             filePath, FileUtil.getReadableFileSize(filePath), stopwatch);
  }

  private SerializationUtil() {
  }
}
