package com.pld.mft.catalog.service;

import java.security.SecureRandom;
import java.util.function.Predicate;
import org.springframework.stereotype.Component;

/** Generates 12-character row ids: a 4-character table prefix plus 8 random alphanumerics. */
@Component
public class IdGenerator {

  public static final String SUPPLIER = "SUP_";
  public static final String PART = "PRT_";
  public static final String BOX = "BOX_";
  public static final String PALLET = "PLT_";
  public static final String MODEL = "MDL_";
  public static final String WORKSHOP = "WSP_";
  public static final String LINE = "LNE_";
  public static final String BREAKPOINT = "BPT_";

  private static final String ALPHABET =
      "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";
  private static final int RANDOM_LENGTH = 8;
  private static final int MAX_ATTEMPTS = 5;

  private final SecureRandom random = new SecureRandom();

  public String newId(String prefix) {
    StringBuilder sb = new StringBuilder(prefix.length() + RANDOM_LENGTH).append(prefix);
    for (int i = 0; i < RANDOM_LENGTH; i++) {
      sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
    }
    return sb.toString();
  }

  /** Draws ids until one is not {@code taken}. */
  public String newUniqueId(String prefix, Predicate<String> taken) {
    for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
      String id = newId(prefix);
      if (!taken.test(id)) {
        return id;
      }
    }
    throw new IllegalStateException(
        "No free id with prefix %s after %d attempts".formatted(prefix, MAX_ATTEMPTS));
  }
}
