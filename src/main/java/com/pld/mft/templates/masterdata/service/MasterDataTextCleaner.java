package com.pld.mft.templates.masterdata.service;

import com.pld.mft.service.contract.RowNormalizer;
import com.pld.mft.templates.masterdata.dto.MasterDataRowDto;
import java.util.Arrays;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Normalizes supplier and part names so the same name typed differently maps to one row:
 * "ACME-steelWorks/2" becomes "Acme Steel Works 2".
 */
@Component
public class MasterDataTextCleaner implements RowNormalizer<MasterDataRowDto> {

  private static final Pattern CAMEL_BOUNDARY = Pattern.compile("(\\p{Ll})(\\p{Lu})");
  private static final Pattern NUMBER = Pattern.compile("(\\d+(?:\\.\\d+)?)");
  private static final Pattern PUNCTUATION = Pattern.compile("[\\p{Punct}\\n\\t]");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  @Override
  public void normalize(MasterDataRowDto row) {
    row.setSupplierName(clean(row.getSupplierName()));
    row.setPartName(clean(row.getPartName()));
  }

  /** Null, or a value with nothing left after cleaning, gives null. */
  public static String clean(String value) {
    if (value == null) {
      return null;
    }
    String text = CAMEL_BOUNDARY.matcher(value).replaceAll("$1 $2");
    text = NUMBER.matcher(text).replaceAll(" $1 ");
    text = PUNCTUATION.matcher(text).replaceAll(" ");
    text = WHITESPACE.matcher(text).replaceAll(" ").trim();
    if (text.isEmpty()) {
      return null;
    }
    return Arrays.stream(text.split(" "))
        .map(MasterDataTextCleaner::titleCase)
        .collect(Collectors.joining(" "));
  }

  private static String titleCase(String word) {
    int firstLength = Character.charCount(word.codePointAt(0));
    return word.substring(0, firstLength).toUpperCase(Locale.ROOT)
        + word.substring(firstLength).toLowerCase(Locale.ROOT);
  }
}
