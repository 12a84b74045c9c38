package org.javai.contextplatform.lifecycle;

/**
 * Whether a canonical key whose versions are all deprecated may be created again.
 */
public enum KeyReusePolicy {

	/**
	 * Deprecating every version frees the key; a new create starts the next major version.
	 */
	RELEASE_ON_DEPRECATION,

	/**
	 * A key stays taken forever once used; the only way forward is a revision.
	 */
	RESERVED
}
