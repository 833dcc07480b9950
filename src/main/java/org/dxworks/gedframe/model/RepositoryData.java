package org.dxworks.gedframe.model;

/**
 * Repositories carry no derived fields yet; they export as an empty object.
 */
public class RepositoryData {
}
