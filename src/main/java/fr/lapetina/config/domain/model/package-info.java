/**
 * Key paths, snapshots and failure descriptions shared by providers and the tree.
 */
package fr.lapetina.config.domain.model;
