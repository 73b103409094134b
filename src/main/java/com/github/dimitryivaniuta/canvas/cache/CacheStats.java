package com.github.dimitryivaniuta.canvas.cache;

/**
 * @param size approximate bytes held; on-disk bytes for the filesystem adapter
 */
public record CacheStats(long hits, long misses, long size, long entries) {}
