package traitgen.core.model;

/** Whether a trait's compatibility rules are enforced. */
public enum TraitRole {
  NORMAL,
  RULER
}
