package traitgen.metadata;

import com.google.gson.JsonObject;
import java.util.List;
import traitgen.core.model.Attribute;
import traitgen.core.model.OutputFormat;

/** Turns one artifact's ordered attribute list into a marketplace metadata document. */
public interface MetadataFormatter {

  MetadataStandard standard();

  JsonObject format(
      String name,
      String description,
      String imageName,
      OutputFormat imageFormat,
      List<Attribute> attributes);
}
