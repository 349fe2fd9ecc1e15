package io.b2mash.eventops.aggregation;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/** Shop variants of the personalised school t-shirt and hoodie, keyed by numeric variant id. */
@Component
public class ClothingCatalog {

  public static final List<String> TSHIRT_SIZES =
      List.of("98/104", "110/116", "122/128", "134/146", "152/164");
  public static final List<String> HOODIE_SIZES = List.of("116", "128", "140", "152", "164");

  private static final Map<String, ClothingVariant> VARIANTS = new LinkedHashMap<>();

  static {
    VARIANTS.put("53328502194522", new ClothingVariant(ClothingType.TSHIRT, "98/104"));
    VARIANTS.put("53328502227290", new ClothingVariant(ClothingType.TSHIRT, "110/116"));
    VARIANTS.put("53328502260058", new ClothingVariant(ClothingType.TSHIRT, "122/128"));
    VARIANTS.put("53328502292826", new ClothingVariant(ClothingType.TSHIRT, "134/146"));
    VARIANTS.put("53328502325594", new ClothingVariant(ClothingType.TSHIRT, "152/164"));
    VARIANTS.put("53328494788954", new ClothingVariant(ClothingType.HOODIE, "116"));
    VARIANTS.put("53328494821722", new ClothingVariant(ClothingType.HOODIE, "128"));
    VARIANTS.put("53328494854490", new ClothingVariant(ClothingType.HOODIE, "140"));
    VARIANTS.put("53328494887258", new ClothingVariant(ClothingType.HOODIE, "152"));
    VARIANTS.put("53328494920026", new ClothingVariant(ClothingType.HOODIE, "164"));
  }

  public Optional<ClothingVariant> lookup(String numericVariantId) {
    return Optional.ofNullable(VARIANTS.get(numericVariantId));
  }

  public boolean isClothing(String numericVariantId) {
    return VARIANTS.containsKey(numericVariantId);
  }

  public enum ClothingType {
    TSHIRT("tshirt", "T-Shirt"),
    HOODIE("hoodie", "Hoodie");

    private final String skuPrefix;
    private final String label;

    ClothingType(String skuPrefix, String label) {
      this.skuPrefix = skuPrefix;
      this.label = label;
    }

    public String skuPrefix() {
      return skuPrefix;
    }

    public String label() {
      return label;
    }
  }

  public record ClothingVariant(ClothingType type, String size) {

    public String sku() {
      return type.skuPrefix() + "-" + size;
    }

    public String displayName() {
      return type.label() + " " + size;
    }
  }
}
