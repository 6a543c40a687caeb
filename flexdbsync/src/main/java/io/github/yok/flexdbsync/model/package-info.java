/**
 * Value types shared by the synchronization components: table and column descriptors read from
 * database metadata, and tracking records.
 */
package io.github.yok.flexdbsync.model;
