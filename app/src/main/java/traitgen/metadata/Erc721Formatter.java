package traitgen.metadata;

import com.google.gson.JsonObject;
import java.util.List;
import traitgen.core.model.Attribute;
import traitgen.core.model.OutputFormat;

/** EVM marketplace layout: name, description, image and the attribute array. */
public final class Erc721Formatter implements MetadataFormatter {

  @Override
  public MetadataStandard standard() {
    return MetadataStandard.ERC721;
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
    json.addProperty("description", description);
    json.addProperty("image", imageName);
    json.add("attributes", Attributes.toJson(attributes));
    return json;
  }
}
