package com.gentoro.inventory.model;

import java.util.Set;

/** Constructs zero-value typed resources from a type tag. */
public interface ResourceFactory {
  Resource create(String type);

  /** Type tags this factory can construct. */
  Set<String> types();
}
