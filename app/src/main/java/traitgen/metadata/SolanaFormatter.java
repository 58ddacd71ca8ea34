package traitgen.metadata;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import java.util.List;
import traitgen.core.model.Attribute;
import traitgen.core.model.OutputFormat;

/**
 * Metaplex layout. Symbol, royalties, creators and collection are left at neutral defaults; the
 * file entry advertises the actual encoded image type.
 */
public final class SolanaFormatter implements MetadataFormatter {

  @Override
  public MetadataStandard standard() {
    return MetadataStandard.SOLANA;
  }

  @Override
  public JsonObject format(
      String name,
      String description,
      String imageName,
      OutputFormat imageFormat,
      List<Attribute> attributes) {
    JsonObject json = new JsonObject();
    json.addProperty("name", name);
    json.addProperty("symbol", "");
    json.addProperty("description", description);
    json.addProperty("image", imageName);
    json.addProperty("seller_fee_basis_points", 0);
    json.add("attributes", Attributes.toJson(attributes));

    JsonObject file = new JsonObject();
    file.addProperty("uri", imageName);
    file.addProperty("type", imageFormat.mimeType());
    JsonArray files = new JsonArray();
    files.add(file);

    JsonObject properties = new JsonObject();
    properties.add("files", files);
    properties.addProperty("category", "image");
    properties.add("creators", new JsonArray());
    json.add("properties", properties);
    json.add("collection", new JsonObject());
    return json;
  }
}
