/**
 * Byte buffers backing reader-side chunk coalescing.
 * <p><strong>Role:</strong> Infrastructure utilities owned by individual tee readers.</p>
 * <p><strong>Concurrency:</strong> Buffers are single-owner; callers provide their own locking.</p>
 * <p><strong>Performance:</strong> Growth-only arrays avoid reallocating on every coalesced burst.</p>
 */
package ca.gc.cra.tee.infrastructure.buffer;
