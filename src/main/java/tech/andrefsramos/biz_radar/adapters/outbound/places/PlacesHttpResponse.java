package tech.andrefsramos.biz_radar.adapters.outbound.places;

/*
 * Resposta crua do diretório de lugares: status HTTP, corpo e o cabeçalho Link (paginação).
 */
public record PlacesHttpResponse(int status, String body, String linkHeader) {

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }
}
