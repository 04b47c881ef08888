package com.aistudio.orchestrator.provider;

/** Image-generation backend used by the illustration and image agents. */
public interface ImageGenerationProvider {

    /**
     * @param prompt full visual description
     * @param style  art style hint, e.g. "watercolor"; may be null
     * @throws ProviderException on transport or API failure
     */
    GeneratedImage generate(String prompt, String style);

    /**
     * @param imageUrl       where the service stored the image
     * @param promptUsed     prompt actually sent
     * @param generationTime wall-clock time of the call, in milliseconds
     */
    record GeneratedImage(String imageUrl, String promptUsed, long generationTime) {}
}
