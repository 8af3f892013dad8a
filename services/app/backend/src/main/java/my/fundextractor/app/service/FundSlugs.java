package my.fundextractor.app.service;

import java.net.URI;
import java.net.URISyntaxException;

public final class FundSlugs {
	private static final String UNKNOWN = "unknown";

	private FundSlugs() {
	}

	public static String fromUrl(String url) {
		if (url == null || url.isBlank()) {
			return UNKNOWN;
		}
		String path;
		try {
			path = new URI(url.trim()).getPath();
		} catch (URISyntaxException ex) {
			path = url.trim();
		}
		if (path == null) {
			return UNKNOWN;
		}
		String[] segments = path.split("/");
		for (int i = segments.length - 1; i >= 0; i--) {
			if (!segments[i].isBlank()) {
				return segments[i];
			}
		}
		return UNKNOWN;
	}
}
