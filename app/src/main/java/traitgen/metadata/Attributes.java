package traitgen.metadata;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import java.util.List;
import traitgen.core.model.Attribute;

final class Attributes {
  private Attributes() {}

  static JsonArray toJson(List<Attribute> attributes) {
    JsonArray array = new JsonArray();
    for (Attribute attribute : attributes) {
      JsonObject entry = new JsonObject();
      entry.addProperty("trait_type", attribute.traitType());
      entry.addProperty("value", attribute.value());
      array.add(entry);
    }
    return array;
  }
}
