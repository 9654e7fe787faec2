package villagecompute.webapp.api.types;

import java.util.List;

/**
 * Ordered set of serialized sitemap XML documents.
 * <p>
 * Document 0 is either the only sitemap or, when the site has more URLs than fit in one sitemap, the sitemap index
 * that links to documents {@code 1..n}. The set is cached and replaced as a unit.
 *
 * @param documents
 *            XML document bodies (never empty)
 */
public record SitemapDocumentSetType(List<String> documents) {

    public SitemapDocumentSetType {
        if (documents == null || documents.isEmpty()) {
            throw new IllegalArgumentException("A sitemap document set needs at least one document");
        }
        documents = List.copyOf(documents);
    }

    /**
     * @return number of documents, index document included
     */
    public int size() {
        return documents.size();
    }

    /**
     * @return true if {@code index} addresses a document of this set
     */
    public boolean contains(int index) {
        return index >= 0 && index < documents.size();
    }

    public String document(int index) {
        return documents.get(index);
    }
}
