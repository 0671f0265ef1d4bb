package photorestore;

import java.io.IOException;

public final class RestorationResponse {

    private final String metadata;
    private final byte[] image;

    public RestorationResponse(String metadata, byte[] image) {
        this.metadata = metadata;
        this.image = image;
    }

    public String getMetadata() {
        return metadata;
    }

    public byte[] getImage() {
        return image.clone();
    }

    public PixelGrid decode() throws IOException {
        return ImageCodec.decode(image);
    }
}
