package org.springaicommunity.github.chronicle;

/**
 * A repository branch.
 *
 * @param name branch name
 * @param sha head commit
 */
public record Branch(String name, String sha) {
}
