package com.drinkjoy.catalog.infrastructure.adapter.source;

import retrofit2.Call;
import retrofit2.http.GET;
import retrofit2.http.Path;
import retrofit2.http.Query;

public interface SheetsValuesApi {

    @GET("v4/spreadsheets/{spreadsheetId}/values/{range}")
    Call<ValueRangeResponse> getValues(
            @Path("spreadsheetId") String spreadsheetId,
            @Path("range") String range,
            @Query("key") String apiKey
    );
}
