package org.javai.contextplatform.asset;

public enum TagCategory {
	DOMAIN,
	USE_CASE,
	STATUS
}
