package com.scholary.speech.gateway.api;

import com.scholary.speech.gateway.access.ModelCatalog;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** Lists the models the gateway routes to. */
@RestController
@Tag(name = "Models", description = "Model catalog")
public class ModelController {

  private final ModelCatalog catalog;

  public ModelController(ModelCatalog catalog) {
    this.catalog = catalog;
  }

  @GetMapping("/api/models")
  @Operation(
      summary = "List models",
      description = "Canonical models with their tier, provider and deprecated aliases")
  public List<ModelView> models() {
    String baseline = catalog.baselineModel();
    return catalog.models().stream()
        .map(m -> ModelView.of(m, catalog.aliasesOf(m.name()), m.name().equals(baseline)))
        .toList();
  }
}
