package com.koni.uns.domain.model;

/**
 * Kind of namespace anchored on a hierarchy node.
 */
public enum NamespaceType {
    FUNCTIONAL,
    INFORMATIVE,
    DEFINITIONAL,
    AD_HOC
}
