package com.metamodel.generator.codegen.model.core.context;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Non-fatal findings accumulated during a generation run.
 *
 * Pure structure only: no logging, no formatting, no IO.
 */
@Getter
public class ToolDiagnostics {
  private final List<String> warnings = new ArrayList<>();

  public void warn(String message) {
	  warnings.add(message);
  }

}
